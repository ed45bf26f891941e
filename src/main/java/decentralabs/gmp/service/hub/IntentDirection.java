package decentralabs.gmp.service.hub;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IntentDirection {
    /** Requester escrows on the connected chain, solver pays on the hub. */
    INFLOW("inflow"),
    /** Requester locks on the hub, solver pays on the connected chain. */
    OUTFLOW("outflow");

    private final String wireValue;

    IntentDirection(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
