package com.smartseller.warranty.repository;

import com.smartseller.warranty.domain.model.CustomerProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for the customer read model.
 *
 * @author Warranty Platform Team
 */
@Repository
public interface CustomerProfileRepository extends JpaRepository<CustomerProfile, String> {

    Optional<CustomerProfile> findByEmailIgnoreCase(String email);
}
