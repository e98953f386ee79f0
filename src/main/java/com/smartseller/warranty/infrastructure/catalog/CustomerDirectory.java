package com.smartseller.warranty.infrastructure.catalog;

import java.util.Optional;

/**
 * Read-only customer lookup capability.
 *
 * @author Warranty Platform Team
 */
public interface CustomerDirectory {

    Optional<String> lookupCustomerByEmail(String email);

    Optional<CustomerContact> lookupContact(String customerId);
}
