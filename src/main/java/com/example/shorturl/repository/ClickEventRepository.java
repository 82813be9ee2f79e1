package com.example.shorturl.repository;

import com.example.shorturl.model.ClickEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface ClickEventRepository extends JpaRepository<ClickEvent, Long> {

    long countByUrlId(String urlId);

    @Modifying
    @Query("DELETE FROM ClickEvent c WHERE c.clickedAt < :before")
    int deleteOlderThan(@Param("before") Instant before);
}
