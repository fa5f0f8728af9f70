package stressrunner;

public enum Variant {
    PLAIN(false, false, false),
    RECOVER(true, false, false),
    UPGRADE(false, true, false),
    UPGRADE_RECOVER(true, true, false),
    DOUBLE_UPGRADE(false, true, true),
    DOUBLE_UPGRADE_RECOVER(true, true, true);

    private final boolean recover;
    private final boolean upgrade;
    private final boolean doubled;

    private Variant(boolean recover, boolean upgrade, boolean doubled) {
        this.recover = recover;
        this.upgrade = upgrade;
        this.doubled = doubled;
    }

    public boolean isRecover() {
        return recover;
    }

    public boolean isUpgrade() {
        return upgrade;
    }

    public boolean isDoubled() {
        return doubled;
    }
}
