package tech.andrefsramos.biz_radar.core.exception;

import java.util.List;

public class InvalidSettingsException extends RuntimeException {

    private final List<String> errors;

    public InvalidSettingsException(List<String> errors) {
        super("Invalid monitoring settings: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
