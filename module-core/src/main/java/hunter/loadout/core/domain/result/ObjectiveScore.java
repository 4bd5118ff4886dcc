package hunter.loadout.core.domain.result;

/**
 * Achieved values of the three prioritized objective terms.
 *
 * @param primary Σ weight × capped level over requested skills
 * @param secondary Σ tier weight × free slots
 * @param tertiary Σ effective level over all skills
 */
public record ObjectiveScore(long primary, long secondary, long tertiary) {}
