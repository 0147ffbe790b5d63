package sp.sistemaspalacios.api_hrcore.service.leave;

/**
 * How an approved leave spanning several calendar years gives days back to
 * each year's balance on cancellation.
 */
public enum CrossYearRestoration {
    /** Mon-Fri count of each year's slice of the range. */
    WEEKDAY_APPROXIMATION,
    /** Sum of the persisted per-day ledger within each year's slice. */
    DAY_DETAILS
}
