/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.phone;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.PhoneNumberUtil.PhoneNumberFormat;
import com.google.i18n.phonenumbers.Phonenumber.PhoneNumber;
import java.util.Objects;

/** {@link PhoneValidator} backed by Google's libphonenumber metadata. */
public final class LibPhoneNumberValidator implements PhoneValidator {
    private final PhoneNumberUtil util;

    public LibPhoneNumberValidator() {
        this(PhoneNumberUtil.getInstance());
    }

    public LibPhoneNumberValidator(PhoneNumberUtil util) {
        this.util = Objects.requireNonNull(util, "util");
    }

    @Override
    public PhoneValidation validate(String candidate, String region) {
        if (candidate == null || candidate.isBlank()) return PhoneValidation.invalid();
        try {
            PhoneNumber number = util.parse(candidate, region);
            if (!util.isValidNumberForRegion(number, region)) return PhoneValidation.invalid();
            return PhoneValidation.valid(util.format(number, PhoneNumberFormat.E164));
        } catch (NumberParseException e) {
            // not a phone number at all
            return PhoneValidation.invalid();
        }
    }
}
