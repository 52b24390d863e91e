package io.github.monossa.ssa;

import io.github.monossa.ext.CommonExts;
import io.github.monossa.ext.Ext;
import io.github.monossa.ext.ExtContainer;
import io.github.monossa.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A basic block: typed parameters, a list of effects, and exactly one control.
 * <p>
 * Parameters take the place of phi nodes. Every jump to a block passes one argument per parameter,
 * so the value of a parameter is chosen by whichever predecessor jumped to the block.
 */
public final class BasicBlock extends ExtHolder {
    public final int id;
    private final List<Var> params = new ArrayList<>();
    private final List<Effect> effects = new ArrayList<>();
    private Control control;

    BasicBlock(int id) {
        this.id = id;
    }

    public String toTargetString() {
        return "@b" + id;
    }

    private <T extends ExtContainer> T registerWithThis(T extable) {
        extable.attachExt(CommonExts.OWNING_BLOCK, this);
        return extable;
    }

    public List<Var> getParams() {
        return Collections.unmodifiableList(params);
    }

    public void addParam(Var param) {
        param.attachExt(CommonExts.PARAMETER_OF, this);
        params.add(param);
    }

    public List<Effect> getEffects() {
        return Collections.unmodifiableList(effects);
    }

    public void addEffect(Effect effect) {
        if (control != null) {
            throw new IllegalStateException(String.format(
                    "Cannot insert %s into terminated block %s", effect, toTargetString()));
        }
        effects.add(registerWithThis(effect));
    }

    @Nullable
    public Control getControl() {
        return control;
    }

    /**
     * Set the control of this block, terminating it.
     *
     * @param control The control.
     * @throws IllegalStateException If the block was already terminated.
     */
    public void setControl(Control control) {
        if (this.control != null) {
            throw new IllegalStateException(String.format(
                    "Block %s is already terminated by %s, cannot terminate with %s",
                    toTargetString(), this.control, control));
        }
        this.control = registerWithThis(control);
    }

    public boolean isTerminated() {
        return control != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString());
        if (!params.isEmpty()) {
            sb.append(params.stream()
                    .map(param -> param + ": " + param.type)
                    .collect(Collectors.joining(", ", "(", ")")));
        }
        sb.append("\n{\n");
        for (Effect effect : effects) {
            sb.append(' ').append(effect).append('\n');
        }
        sb.append(' ').append(control == null ? "<unterminated>" : control);
        sb.append("\n}");
        return sb.toString();
    }

    // exts
    private Function owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
