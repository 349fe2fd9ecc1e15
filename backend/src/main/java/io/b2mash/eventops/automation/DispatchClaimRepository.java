package io.b2mash.eventops.automation;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DispatchClaimRepository extends JpaRepository<DispatchClaim, UUID> {}
