package com.platform.fleetsync.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Pattern;

/**
 * Validator for {@link SafeText}.
 */
public class SafeTextValidator implements ConstraintValidator<SafeText, String> {
    
    private static final Pattern HTML_TAG_PATTERN = Pattern.compile("<[^>]+>");
    private static final Pattern CONTROL_PATTERN = Pattern.compile("[\\p{Cntrl}&&[^\\r\\n\\t]]");
    
    private int maxLength;
    private boolean allowNewlines;
    
    @Override
    public void initialize(SafeText constraintAnnotation) {
        this.maxLength = constraintAnnotation.maxLength();
        this.allowNewlines = constraintAnnotation.allowNewlines();
    }
    
    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null) {
            return true; // Use @NotNull for null checks
        }
        
        if (value.length() > maxLength) {
            setMessage(context, "Input exceeds maximum length of " + maxLength);
            return false;
        }
        
        if (CONTROL_PATTERN.matcher(value).find()) {
            setMessage(context, "Control characters are not allowed");
            return false;
        }
        
        if (!allowNewlines && (value.contains("\n") || value.contains("\r"))) {
            setMessage(context, "Newlines are not allowed");
            return false;
        }
        
        if (HTML_TAG_PATTERN.matcher(value).find()) {
            setMessage(context, "HTML tags are not allowed");
            return false;
        }
        
        return true;
    }
    
    private void setMessage(ConstraintValidatorContext context, String message) {
        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(message).addConstraintViolation();
    }
}
