package com.example.triprisk_backend.weather;

/** What one provider contributed to a chain run; never carries an exception across the chain. */
public record ProviderOutcome(String providerId, Status status, Forecast forecast, String detail) {

    public enum Status {USABLE, UNUSABLE, FAILED, SKIPPED}

    static ProviderOutcome usable(String id, Forecast f) {return new ProviderOutcome(id, Status.USABLE, f, null);}

    static ProviderOutcome unusable(String id) {return new ProviderOutcome(id, Status.UNUSABLE, null, "no forecast near target time");}

    static ProviderOutcome failed(String id, Throwable e) {return new ProviderOutcome(id, Status.FAILED, null, e.toString());}

    static ProviderOutcome skipped(String id) {return new ProviderOutcome(id, Status.SKIPPED, null, "disabled");}

    public boolean isUsable() {return status == Status.USABLE;}
}
