package io.github.monossa.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A key for a piece of data of type {@code T} that can be attached to any {@link ExtContainer}.
 * <p>
 * Exts are compared by identity; their order is the order they were {@link #create(Class, String) created} in.
 *
 * @param <T> The type of the attached data.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<?> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * The class is only used for display, so a raw class may be given for generic data.
     *
     * @param type The class of the data, or its raw superclass.
     * @param name The name of the ext, for display.
     * @param <T>  The class type.
     * @param <R>  The type of the data.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    public Optional<T> getIn(ExtContainer container) {
        return container.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
