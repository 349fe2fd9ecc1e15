package io.b2mash.eventops.contact;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ParentContactRepository extends JpaRepository<ParentContact, UUID> {

  List<ParentContact> findByEmailIgnoreCase(String email);
}
