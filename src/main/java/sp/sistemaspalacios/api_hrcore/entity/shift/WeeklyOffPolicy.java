package sp.sistemaspalacios.api_hrcore.entity.shift;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "weekly_off_policies")
@Data
public class WeeklyOffPolicy {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    // JSON: [5, 6] (0 = Monday) or {"saturday": true, "sunday": true}
    @Column(nullable = false, columnDefinition = "TEXT")
    private String days;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;
}
