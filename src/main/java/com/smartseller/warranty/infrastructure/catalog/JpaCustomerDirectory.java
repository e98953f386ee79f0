package com.smartseller.warranty.infrastructure.catalog;

import com.smartseller.warranty.exception.DependencyFailureException;
import com.smartseller.warranty.repository.CustomerProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Customer directory backed by the replicated customer_profiles table.
 *
 * @author Warranty Platform Team
 */
@Component
public class JpaCustomerDirectory implements CustomerDirectory {

    private static final Logger logger = LoggerFactory.getLogger(JpaCustomerDirectory.class);

    private final CustomerProfileRepository customerProfileRepository;

    public JpaCustomerDirectory(CustomerProfileRepository customerProfileRepository) {
        this.customerProfileRepository = customerProfileRepository;
    }

    @Override
    public Optional<String> lookupCustomerByEmail(String email) {
        try {
            return customerProfileRepository.findByEmailIgnoreCase(email)
                    .map(profile -> profile.getCustomerId());
        } catch (DataAccessResourceFailureException e) {
            logger.error("Customer read model unavailable", e);
            throw new DependencyFailureException("customer-directory", "Customer lookup unavailable", e);
        }
    }

    @Override
    public Optional<CustomerContact> lookupContact(String customerId) {
        try {
            return customerProfileRepository.findById(customerId)
                    .map(profile -> new CustomerContact(profile.getCustomerId(), profile.getFullName(),
                            profile.getEmail(), profile.getPhone(), profile.getAddress()));
        } catch (DataAccessResourceFailureException e) {
            logger.error("Customer read model unavailable for customer {}", customerId, e);
            throw new DependencyFailureException("customer-directory", "Customer lookup unavailable", e);
        }
    }
}
