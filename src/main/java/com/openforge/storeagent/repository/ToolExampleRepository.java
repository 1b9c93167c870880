package com.openforge.storeagent.repository;

import com.openforge.storeagent.domain.ToolExample;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ToolExampleRepository extends JpaRepository<ToolExample, Long> {

    Optional<ToolExample> findFirstByToolNameAndExampleQueryOrderByIdAsc(String toolName, String exampleQuery);

    long countByIsLearnedTrue();

    /**
     * Single-statement increment; concurrent callers never lose an update
     * because the database serializes the row write.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ToolExample e
               set e.usageCount = e.usageCount + 1,
                   e.updateTime = :now
             where e.id = :id
            """)
    int incrementUsage(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Query("select e.domain, count(e) from ToolExample e group by e.domain order by e.domain")
    List<Object[]> countPerDomain();

    /** Administrative cleanup before a re-seed; learned rows are kept. */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("delete from ToolExample e where e.isLearned = false")
    int deleteCurated();
}
