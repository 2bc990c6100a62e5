package com.platform.fleetsync.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

/**
 * Free text that ends up in device query strings or logs: names, descriptions.
 * Rejects control characters and markup.
 */
@Documented
@Constraint(validatedBy = SafeTextValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface SafeText {
    
    String message() default "Invalid characters in input";
    
    Class<?>[] groups() default {};
    
    Class<? extends Payload>[] payload() default {};
    
    int maxLength() default 255;
    
    boolean allowNewlines() default false;
}
