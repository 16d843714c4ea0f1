package io.veomenu.backend.instance;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface InstanceRepository extends JpaRepository<Instance, UUID> {

  boolean existsBySlug(String slug);
}
