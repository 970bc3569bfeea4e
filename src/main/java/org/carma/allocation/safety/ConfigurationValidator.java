package org.carma.allocation.safety;

import org.carma.allocation.model.*;

import java.util.*;

/**
 * Validation of plans, queries and price parameters at configure/submit time.
 *
 * Validates:
 * - Plan ids present and unique, budgets finite and non-negative
 * - Query values finite and non-negative
 * - Cost vectors one entry per plan, each entry non-negative and finite or unknown (NaN)
 * - Activation costs finite and non-negative
 * - Price parameters in range, iteration caps positive
 *
 * Plans with zero budget pass with a warning: they are infeasible resources and
 * are reported by the engine rather than rejected.
 */
public class ConfigurationValidator {

    /**
     * Result of configuration validation.
     */
    public static class ValidationResult {
        private final List<ValidationError> errors;
        private final List<ValidationWarning> warnings;

        public ValidationResult(List<ValidationError> errors, List<ValidationWarning> warnings) {
            this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
            this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        }

        public boolean isValid() { return errors.isEmpty(); }
        public List<ValidationError> getErrors() { return errors; }
        public List<ValidationWarning> getWarnings() { return warnings; }
        public boolean hasWarnings() { return !warnings.isEmpty(); }

        /**
         * @throws ConfigurationException if any error was found
         */
        public ValidationResult orThrow() {
            if (!isValid()) {
                throw new ConfigurationException(errors);
            }
            return this;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(isValid() ? "VALID" : "INVALID");
            if (!errors.isEmpty()) {
                sb.append(" (").append(errors.size()).append(" errors)");
            }
            if (!warnings.isEmpty()) {
                sb.append(" (").append(warnings.size()).append(" warnings)");
            }
            return sb.toString();
        }
    }

    public static class ValidationError {
        private final String category;
        private final String field;
        private final String message;

        public ValidationError(String category, String field, String message) {
            this.category = category;
            this.field = field;
            this.message = message;
        }

        public String getCategory() { return category; }
        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("[%s] %s: %s", category, field, message);
        }
    }

    public static class ValidationWarning {
        private final String category;
        private final String message;

        public ValidationWarning(String category, String message) {
            this.category = category;
            this.message = message;
        }

        public String getCategory() { return category; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("[%s] %s", category, message);
        }
    }

    // ========================================================================
    // PLAN VALIDATION
    // ========================================================================

    public ValidationResult validatePlans(List<Plan> plans) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        if (plans == null || plans.isEmpty()) {
            errors.add(new ValidationError("Plan", "plans", "at least one plan is required"));
            return new ValidationResult(errors, warnings);
        }

        Set<String> seen = new HashSet<>();
        for (int j = 0; j < plans.size(); j++) {
            Plan plan = plans.get(j);
            String field = "plans[" + j + "]";
            if (plan == null) {
                errors.add(new ValidationError("Plan", field, "plan is null"));
                continue;
            }
            if (plan.getId() == null || plan.getId().isBlank()) {
                errors.add(new ValidationError("Plan", field + ".id", "id is required"));
            } else if (!seen.add(plan.getId())) {
                errors.add(new ValidationError("Plan", field + ".id", "duplicate plan id " + plan.getId()));
            }

            double budget = plan.getBudget();
            if (Double.isNaN(budget) || Double.isInfinite(budget)) {
                errors.add(new ValidationError("Plan", field + ".budget", "budget must be finite, got " + budget));
            } else if (budget < 0) {
                errors.add(new ValidationError("Plan", field + ".budget", "budget must be non-negative, got " + budget));
            } else if (budget == 0) {
                warnings.add(new ValidationWarning("InfeasibleResource",
                    "plan " + plan.getId() + " has no budget and will never receive queries"));
            }
        }

        return new ValidationResult(errors, warnings);
    }

    // ========================================================================
    // QUERY VALIDATION
    // ========================================================================

    public ValidationResult validateQuery(Query query, int planCount) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        if (query == null) {
            errors.add(new ValidationError("Query", "query", "query is null"));
            return new ValidationResult(errors, warnings);
        }

        String prefix = "query[" + query.getId() + "]";
        if (query.getId() == null || query.getId().isBlank()) {
            errors.add(new ValidationError("Query", "query.id", "id is required"));
        }

        if (!Double.isFinite(query.getValue()) || query.getValue() < 0) {
            errors.add(new ValidationError("Query", prefix + ".value",
                "value must be finite and non-negative, got " + query.getValue()));
        }

        if (!Double.isFinite(query.getActivationCost()) || query.getActivationCost() < 0) {
            errors.add(new ValidationError("Query", prefix + ".activationCost",
                "activation cost must be finite and non-negative, got " + query.getActivationCost()));
        }

        errors.addAll(validateCosts(prefix, query.getAssignmentCosts(), planCount));

        if (errors.isEmpty() && Double.isInfinite(query.getMinimumCost())) {
            warnings.add(new ValidationWarning("Query",
                prefix + " has no known cost and will be deferred until its costs are revealed"));
        }

        return new ValidationResult(errors, warnings);
    }

    /**
     * Cost vectors: one entry per plan, each non-negative and finite, or NaN for unknown.
     */
    public List<ValidationError> validateCosts(String prefix, double[] costs, int planCount) {
        List<ValidationError> errors = new ArrayList<>();
        if (costs == null || costs.length != planCount) {
            errors.add(new ValidationError("Query", prefix + ".assignmentCosts", String.format(
                "expected %d costs, got %d", planCount, costs == null ? 0 : costs.length)));
            return errors;
        }
        for (int j = 0; j < costs.length; j++) {
            double c = costs[j];
            if (Double.isNaN(c)) continue;
            if (Double.isInfinite(c) || c < 0) {
                errors.add(new ValidationError("Query", prefix + ".assignmentCosts[" + j + "]",
                    "cost must be finite and non-negative, got " + c));
            }
        }
        return errors;
    }

    // ========================================================================
    // PARAMETER VALIDATION
    // ========================================================================

    public ValidationResult validateParams(PriceUpdateParams params) {
        List<ValidationError> errors = new ArrayList<>();

        if (params == null) {
            errors.add(new ValidationError("Pricing", "params", "price parameters are required"));
            return new ValidationResult(errors, Collections.emptyList());
        }
        if (!Double.isFinite(params.getEpsilon()) || params.getEpsilon() < 0) {
            errors.add(new ValidationError("Pricing", "epsilon", "must be finite and non-negative"));
        }
        if (!Double.isFinite(params.getDelta()) || params.getDelta() < 0) {
            errors.add(new ValidationError("Pricing", "delta", "must be finite and non-negative"));
        }
        if (!(params.getHighUtilization() > 0 && params.getHighUtilization() <= 1)) {
            errors.add(new ValidationError("Pricing", "highUtilization", "must be in (0, 1]"));
        }
        if (!Double.isFinite(params.getInitialPrice()) || params.getInitialPrice() < 0) {
            errors.add(new ValidationError("Pricing", "initialPrice", "must be finite and non-negative"));
        }
        if (Double.isNaN(params.getRevisionBudget()) || params.getRevisionBudget() < 0) {
            errors.add(new ValidationError("Pricing", "revisionBudget", "must be non-negative"));
        }
        if (params.getMaxIterations() <= 0) {
            errors.add(new ValidationError("Pricing", "maxIterations", "must be positive"));
        }
        if (params.getMaxRounds() <= 0) {
            errors.add(new ValidationError("Pricing", "maxRounds", "must be positive"));
        }
        if (!Double.isFinite(params.getTolerance()) || params.getTolerance() < 0) {
            errors.add(new ValidationError("Pricing", "tolerance", "must be finite and non-negative"));
        }

        return new ValidationResult(errors, Collections.emptyList());
    }
}
