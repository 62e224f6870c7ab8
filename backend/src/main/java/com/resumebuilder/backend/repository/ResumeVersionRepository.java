package com.resumebuilder.backend.repository;

import com.resumebuilder.backend.entity.ResumeVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ResumeVersionRepository extends JpaRepository<ResumeVersion, String> {

    List<ResumeVersion> findByResumeIdAndUserIdOrderByVersionNumberDesc(String resumeId, String userId);

    Optional<ResumeVersion> findByIdAndResumeIdAndUserId(String id, String resumeId, String userId);

    long countByResumeId(String resumeId);

    @Query("select v.id from ResumeVersion v where v.resumeId = :resumeId order by v.versionNumber desc")
    List<String> findIdsByResumeIdNewestFirst(@Param("resumeId") String resumeId);

    @Query("select max(v.versionNumber) from ResumeVersion v where v.resumeId = :resumeId")
    Optional<Integer> findMaxVersionNumber(@Param("resumeId") String resumeId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from ResumeVersion v where v.id in :ids")
    int deleteByIdIn(@Param("ids") Collection<String> ids);
}
