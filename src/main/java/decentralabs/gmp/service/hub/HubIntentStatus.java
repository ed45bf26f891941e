package decentralabs.gmp.service.hub;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HubIntentStatus {
    AWAITING_ESCROW("awaiting_escrow"),
    ESCROW_CONFIRMED("escrow_confirmed"),
    REQUIREMENTS_SENT("requirements_sent"),
    FULFILLED("fulfilled"),
    CANCELLED("cancelled");

    private final String wireValue;

    HubIntentStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this == FULFILLED || this == CANCELLED;
    }
}
