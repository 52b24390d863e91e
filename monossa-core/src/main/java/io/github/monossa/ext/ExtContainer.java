package io.github.monossa.ext;

import io.github.monossa.passes.IRPass;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something {@link Ext}s can be attached to.
 * <p>
 * IR objects extend {@link ExtHolder}, so passes can hang scratch or derived data
 * (predecessors, defining instructions, ownership) off them without extra maps.
 */
public interface ExtContainer {
    <T> void attachExt(Ext<T> ext, T value);

    <T> void removeExt(Ext<T> ext);

    /**
     * Get the data attached for {@code ext}, or null if there is none.
     *
     * @param ext The ext.
     * @param <T> The type of the data.
     * @return The data, or null.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the data attached for {@code ext}.
     *
     * @param ext The ext.
     * @param <T> The type of the data.
     * @return The data.
     * @throws IllegalStateException If nothing is attached.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value != null) return value;
        throw new IllegalStateException(String.format("Ext %s not present on %s", ext, this));
    }

    /**
     * Get the data attached for {@code ext}, running a pass which computes it if it is missing.
     *
     * @param ext  The ext.
     * @param o    The IR to run the pass on.
     * @param pass The pass which attaches the ext.
     * @param <T>  The type of the data.
     * @param <O>  The type of IR the pass runs on.
     * @return The data.
     */
    default <T, O> T getExtOrRun(Ext<T> ext, O o, IRPass<O, ?> pass) {
        T value = getNullable(ext);
        if (value != null) return value;
        pass.run(o);
        return getExtOrThrow(ext);
    }
}
