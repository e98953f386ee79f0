package com.smartseller.warranty.infrastructure.catalog;

/**
 * Customer contact snapshot as held by the customer service.
 *
 * @author Warranty Platform Team
 */
public class CustomerContact {

    private final String customerId;
    private final String name;
    private final String email;
    private final String phone;
    private final String address;

    public CustomerContact(String customerId, String name, String email, String phone, String address) {
        this.customerId = customerId;
        this.name = name;
        this.email = email;
        this.phone = phone;
        this.address = address;
    }

    public String getCustomerId() { return customerId; }
    public String getName() { return name; }
    public String getEmail() { return email; }
    public String getPhone() { return phone; }
    public String getAddress() { return address; }
}
