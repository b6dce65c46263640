package uk.gegc.linguapractice.shared.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.linguapractice.shared.exception.ValidationException;

import java.util.Comparator;
import java.util.Set;

/**
 * Runs bean validation on service inputs and reports the first violation, ordered by
 * property path, as a {@link ValidationException}.
 */
@Component
@RequiredArgsConstructor
public class InputValidator {

    private final Validator validator;

    public <T> T validate(T input, String name) {
        if (input == null) {
            throw new ValidationException(name + " is required", name, null);
        }
        Set<ConstraintViolation<T>> violations = validator.validate(input);
        violations.stream()
                .min(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                .ifPresent(violation -> {
                    String field = violation.getPropertyPath().toString();
                    throw new ValidationException(field + " " + violation.getMessage(), field, violation.getInvalidValue());
                });
        return input;
    }
}
