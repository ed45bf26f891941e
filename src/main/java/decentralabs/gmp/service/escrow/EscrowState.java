package decentralabs.gmp.service.escrow;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EscrowState {
    OPEN("open"),
    RELEASED("released"),
    CANCELLED("cancelled");

    private final String wireValue;

    EscrowState(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this != OPEN;
    }
}
