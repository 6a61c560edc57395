package com.bank.lease.domain.model;

import com.bank.lease.domain.enums.FieldGroup;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Lease fields an amendment may change or restate, keyed by their snake_case name
 */
public enum LeaseField {
    TENANT("tenant", FieldGroup.PARTY, String.class,
            Lease::getTenant, (lease, v) -> lease.setTenant((String) v)),
    LANDLORD("landlord", FieldGroup.PARTY, String.class,
            Lease::getLandlord, (lease, v) -> lease.setLandlord((String) v)),
    PROPERTY_ADDRESS("property_address", FieldGroup.PROPERTY, PropertyAddress.class,
            Lease::getPropertyAddress, (lease, v) -> lease.setPropertyAddress((PropertyAddress) v)),
    RENTABLE_SQUARE_FEET("rentable_square_feet", FieldGroup.PROPERTY, BigDecimal.class,
            Lease::getRentableSquareFeet, (lease, v) -> lease.setRentableSquareFeet((BigDecimal) v)),
    USABLE_SQUARE_FEET("usable_square_feet", FieldGroup.PROPERTY, BigDecimal.class,
            Lease::getUsableSquareFeet, (lease, v) -> lease.setUsableSquareFeet((BigDecimal) v)),
    COMMENCEMENT_DATE("commencement_date", FieldGroup.TERM, LocalDate.class,
            Lease::getCommencementDate, (lease, v) -> lease.setCommencementDate((LocalDate) v)),
    EXPIRATION_DATE("expiration_date", FieldGroup.TERM, LocalDate.class,
            Lease::getExpirationDate, (lease, v) -> lease.setExpirationDate((LocalDate) v)),
    TERM_MONTHS("term_months", FieldGroup.TERM, Integer.class,
            Lease::getTermMonths, (lease, v) -> lease.setTermMonths((Integer) v)),
    BASE_RENT_MONTHLY("base_rent_monthly", FieldGroup.RENT, BigDecimal.class,
            Lease::getBaseRentMonthly, (lease, v) -> lease.setBaseRentMonthly((BigDecimal) v)),
    BASE_RENT_ANNUAL("base_rent_annual", FieldGroup.RENT, BigDecimal.class,
            Lease::getBaseRentAnnual, (lease, v) -> lease.setBaseRentAnnual((BigDecimal) v)),
    RENT_PER_SQUARE_FOOT("rent_per_square_foot", FieldGroup.RENT, BigDecimal.class,
            Lease::getRentPerSquareFoot, (lease, v) -> lease.setRentPerSquareFoot((BigDecimal) v)),
    SECURITY_DEPOSIT("security_deposit", FieldGroup.RENT, BigDecimal.class,
            Lease::getSecurityDeposit, (lease, v) -> lease.setSecurityDeposit((BigDecimal) v));

    private final String fieldName;
    private final FieldGroup group;
    private final Class<?> valueType;
    private final Function<Lease, Object> getter;
    private final BiConsumer<Lease, Object> setter;

    LeaseField(String fieldName, FieldGroup group, Class<?> valueType,
               Function<Lease, Object> getter, BiConsumer<Lease, Object> setter) {
        this.fieldName = fieldName;
        this.group = group;
        this.valueType = valueType;
        this.getter = getter;
        this.setter = setter;
    }

    public String getFieldName() {
        return fieldName;
    }

    public FieldGroup getGroup() {
        return group;
    }

    public Object read(Lease lease) {
        return lease == null ? null : getter.apply(lease);
    }

    /**
     * Read a raw change-set value as this field's type
     * @throws com.bank.lease.domain.exception.FieldValueException if the value is malformed
     */
    public Object coerce(Object raw) {
        return FieldValues.coerce(fieldName, raw, valueType);
    }

    public void apply(Lease lease, Object raw) {
        setter.accept(lease, coerce(raw));
    }

    public static Optional<LeaseField> fromFieldName(String fieldName) {
        return Arrays.stream(values())
                .filter(f -> f.fieldName.equals(fieldName))
                .findFirst();
    }
}
