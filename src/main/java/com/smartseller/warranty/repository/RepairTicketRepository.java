package com.smartseller.warranty.repository;

import com.smartseller.warranty.domain.model.RepairTicket;
import com.smartseller.warranty.domain.model.RepairTicket.TicketStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for RepairTicket entity.
 *
 * @author Warranty Platform Team
 */
@Repository
public interface RepairTicketRepository extends JpaRepository<RepairTicket, String> {

    Optional<RepairTicket> findByTicketNumber(String ticketNumber);

    List<RepairTicket> findByClaimIdOrderByCreatedAtDesc(String claimId);

    /**
     * The live repair attempt of a claim (latest ticket not cancelled).
     */
    Optional<RepairTicket> findFirstByClaimIdAndStatusNotOrderByCreatedAtDesc(String claimId, TicketStatus excluded);

    Page<RepairTicket> findByTechnicianIdOrderByCreatedAtDesc(String technicianId, Pageable pageable);
}
