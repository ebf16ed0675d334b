package in.cryptai.domain.signal;

/**
 * Result of SlotManager.acquire. ACQUIRED means the caller's transaction now
 * holds the slot row lock and must either finalize and commit, or roll back.
 */
public record SlotAcquisition(Status status, GenerationSlot slot) {

    public enum Status {
        ALREADY_DONE,
        ACQUIRED
    }

    public static SlotAcquisition alreadyDone(GenerationSlot slot) {
        return new SlotAcquisition(Status.ALREADY_DONE, slot);
    }

    public static SlotAcquisition acquired(GenerationSlot slot) {
        return new SlotAcquisition(Status.ACQUIRED, slot);
    }

    public boolean isAlreadyDone() {
        return status == Status.ALREADY_DONE;
    }
}
