package org.geoingest.repository;

import org.geoingest.models.entity.DataRecordIndex;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface DataRecordIndexRepository extends JpaRepository<DataRecordIndex, UUID> {
}
