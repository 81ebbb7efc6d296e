package io.opsmesh.emergency;

/**
 * One protocol tag bound to the code that carries it out.
 */
public record InterventionStep(InterventionProtocol protocol, Handler handler) {

    @FunctionalInterface
    public interface Handler {
        StepOutcome apply(EmergencyEvent event) throws Exception;
    }

    public record StepOutcome(InterventionProtocol protocol, boolean success, String detail) {
        public static StepOutcome ok(InterventionProtocol protocol, String detail) {
            return new StepOutcome(protocol, true, detail);
        }

        public static StepOutcome fail(InterventionProtocol protocol, String detail) {
            return new StepOutcome(protocol, false, detail);
        }
    }
}
