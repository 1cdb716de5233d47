package at.sv.solar.cli;

public final class InvalidSunEventExpression extends RuntimeException {
    public InvalidSunEventExpression(String message) {
        super(message);
    }
}
