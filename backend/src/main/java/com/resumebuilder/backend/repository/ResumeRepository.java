package com.resumebuilder.backend.repository;

import com.resumebuilder.backend.entity.Resume;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ResumeRepository extends JpaRepository<Resume, String> {

    Optional<Resume> findByIdAndUserIdAndDeletedAtIsNull(String id, String userId);

    List<Resume> findByUserIdAndDeletedAtIsNullOrderByUpdatedAtDesc(String userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Resume r where r.id = :id and r.userId = :userId and r.deletedAt is null")
    Optional<Resume> findActiveByIdAndUserIdForUpdate(@Param("id") String id, @Param("userId") String userId);
}
