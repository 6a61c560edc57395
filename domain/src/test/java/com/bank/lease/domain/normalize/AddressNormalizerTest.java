package com.bank.lease.domain.normalize;

import com.bank.lease.domain.model.PropertyAddress;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AddressNormalizerTest {

    @Test
    void testNormalizeAbbreviates() {
        assertEquals("100 n main st ste 200", AddressNormalizer.normalize("100 North Main Street, Suite 200"));
        assertEquals("100 n main st ste 200", AddressNormalizer.normalize("100 N. Main St. #200"));
    }

    @Test
    void testSameAddressIgnoresMissingParts() {
        PropertyAddress full = PropertyAddress.builder()
                .streetAddress("100 Main Street")
                .city("Springfield")
                .state("IL")
                .zipCode("62701-1234")
                .build();
        PropertyAddress partial = PropertyAddress.builder()
                .streetAddress("100 Main St")
                .zipCode("62701")
                .build();

        assertTrue(AddressNormalizer.sameAddress(full, partial));
    }

    @Test
    void testDifferentStreet() {
        PropertyAddress a = PropertyAddress.builder().streetAddress("100 Main Street").city("Springfield").build();
        PropertyAddress b = PropertyAddress.builder().streetAddress("200 Oak Avenue").city("Springfield").build();

        assertFalse(AddressNormalizer.sameAddress(a, b));
    }
}
