package com.dramacollector.collect.validation;

import com.dramacollector.collect.model.CanonicalRecord;
import com.dramacollector.collect.model.ValidationResult;

public interface RecordValidator {
    ValidationResult validate(CanonicalRecord record);
}
