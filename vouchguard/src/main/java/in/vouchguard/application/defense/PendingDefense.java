package in.vouchguard.application.defense;

import in.vouchguard.domain.alert.Alert;
import in.vouchguard.domain.defense.Defense;

/**
 * A pending alert paired with the active defense prepared for its review.
 */
public record PendingDefense(Alert alert, Defense defense) {}
