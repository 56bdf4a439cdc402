package ru.mirror.relay.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotated string must compile as a {@link java.util.regex.Pattern}. Null and blank values
 * pass; combine with {@code @NotBlank} where a pattern is required.
 */
@Documented
@Constraint(validatedBy = RegexValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidRegex {
    String message() default "PATTERN_DOES_NOT_COMPILE";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
