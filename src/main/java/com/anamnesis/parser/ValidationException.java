package com.anamnesis.parser;

import java.util.List;
import java.util.stream.Collectors;

public class ValidationException extends Exception {
    private final List<ValidationError> errors;

    public ValidationException(List<ValidationError> errors) {
        super(errors.size() + " validation error(s): "
                + errors.stream().map(ValidationError::toString).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> errors() {
        return errors;
    }
}
