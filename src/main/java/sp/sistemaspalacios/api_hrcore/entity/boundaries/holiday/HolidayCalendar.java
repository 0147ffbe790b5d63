package sp.sistemaspalacios.api_hrcore.entity.boundaries.holiday;

import jakarta.persistence.*;
import lombok.Data;

/**
 * A yearly holiday calendar. A null location makes it global.
 */
@Entity
@Table(name = "holiday_calendars")
@Data
public class HolidayCalendar {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "calendar_year", nullable = false)
    private Integer calendarYear;

    @Column(name = "location_id")
    private Long locationId;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;
}
