package in.cryptai.domain.signal;

public enum PersistOutcome {
    COMMITTED,      // rows written and slot finalized in one transaction
    CONFLICT,       // a winner already held a valid signal that day; nothing committed
    ALREADY_DONE    // another run finalized the slot first; nothing written
}
