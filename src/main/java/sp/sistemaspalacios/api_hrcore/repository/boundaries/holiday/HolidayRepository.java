package sp.sistemaspalacios.api_hrcore.repository.boundaries.holiday;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_hrcore.entity.boundaries.holiday.Holiday;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface HolidayRepository extends JpaRepository<Holiday, Long> {

    @Query("SELECT h.holidayDate FROM Holiday h JOIN h.calendar c " +
            "WHERE c.isActive = true AND h.isOptional = false " +
            "AND h.holidayDate BETWEEN :fromDate AND :toDate " +
            "AND (c.locationId = :locationId OR c.locationId IS NULL)")
    List<LocalDate> findMandatoryDatesForLocation(@Param("locationId") Long locationId,
                                                  @Param("fromDate") LocalDate fromDate,
                                                  @Param("toDate") LocalDate toDate);

    @Query("SELECT h.holidayDate FROM Holiday h JOIN h.calendar c " +
            "WHERE c.isActive = true AND h.isOptional = false " +
            "AND h.holidayDate BETWEEN :fromDate AND :toDate " +
            "AND c.locationId IS NULL")
    List<LocalDate> findMandatoryGlobalDates(@Param("fromDate") LocalDate fromDate,
                                             @Param("toDate") LocalDate toDate);

    @Query("SELECT h FROM Holiday h JOIN h.calendar c " +
            "WHERE c.isActive = true " +
            "AND (:year IS NULL OR c.calendarYear = :year) " +
            "AND (:locationId IS NULL OR c.locationId = :locationId OR c.locationId IS NULL) " +
            "ORDER BY h.holidayDate")
    List<Holiday> findActiveHolidays(@Param("year") Integer year,
                                     @Param("locationId") Long locationId);
}
