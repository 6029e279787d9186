package com.example.checkout.domain.model;

/**
 * Shipping address snapshot stored on the order.
 *
 * @param street  street line
 * @param city    city
 * @param state   state or province
 * @param country country
 * @param zipCode postal code
 * @param phone   contact phone, optional
 */
public record ShippingAddress(
        String street,
        String city,
        String state,
        String country,
        String zipCode,
        String phone
) {

    public ShippingAddress {
        requireText(street, "street");
        requireText(city, "city");
        requireText(state, "state");
        requireText(country, "country");
        requireText(zipCode, "zipCode");
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Shipping address " + field + " is required");
        }
    }
}
