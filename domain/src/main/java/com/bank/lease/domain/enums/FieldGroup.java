package com.bank.lease.domain.enums;

/**
 * Family a lease field belongs to; decides which comparator owns a restatement of it
 */
public enum FieldGroup {
    PARTY,
    PROPERTY,
    TERM,
    RENT
}
