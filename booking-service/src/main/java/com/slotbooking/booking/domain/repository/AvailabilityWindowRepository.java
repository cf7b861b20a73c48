package com.slotbooking.booking.domain.repository;

import com.slotbooking.booking.domain.model.AvailabilityWindow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.DayOfWeek;
import java.util.List;

public interface AvailabilityWindowRepository extends JpaRepository<AvailabilityWindow, Long> {

    List<AvailabilityWindow> findByProviderIdAndActiveTrue(Long providerId);

    List<AvailabilityWindow> findByProviderIdAndDayOfWeekAndActiveTrue(Long providerId, DayOfWeek dayOfWeek);

    List<AvailabilityWindow> findByProviderIdOrderByDayOfWeekAscStartTimeAsc(Long providerId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM AvailabilityWindow w WHERE w.providerId = :providerId")
    int deleteByProviderId(@Param("providerId") Long providerId);
}
