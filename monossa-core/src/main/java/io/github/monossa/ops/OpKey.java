package io.github.monossa.ops;

/**
 * An operation key, representing a kind of operation, without intermediates.
 */
public abstract class OpKey {
    public final String mnemonic;

    public OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
