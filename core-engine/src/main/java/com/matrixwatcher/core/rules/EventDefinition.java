package com.matrixwatcher.core.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Declarative description of one external event type.
 *
 * <p>
 * Supported rule types:
 * </p>
 * <ul>
 * <li>{@code crypto_move} - price of {@code asset} moved at least
 * {@code threshold}% up ({@code pump}) or down ({@code dump}) over
 * {@code hours}</li>
 * <li>{@code volatility} - absolute 24h change in {@code field} is at least
 * {@code threshold}%</li>
 * <li>{@code earthquake} - {@code max_magnitude} is at least
 * {@code threshold}</li>
 * <li>{@code solar_storm} - Kp index at least {@code threshold}, or solar wind
 * of 700 km/s or more when {@code threshold} &lt;= 5</li>
 * <li>{@code kp_index} - Kp index at least {@code threshold}</li>
 * <li>{@code blockchain} - some network's block time is at least
 * {@code threshold} times its expected block time</li>
 * <li>{@code news_spike} - new item count at least 25 &times;
 * {@code threshold}</li>
 * <li>{@code randomness} - randomness score below {@code threshold}</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction or deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class EventDefinition {

    public static final String DEFAULT_VOLATILITY_FIELD = "btcusdt.price_change_24h_percent";

    /** Event type, unique within a registry. */
    private String name;

    /** Rule type, one of the values listed above. */
    private String type;

    private String severity = "medium";
    private String category = "other";
    private String description;

    // --- crypto_move ---
    private String asset;
    private String direction;
    private int hours;

    // --- shared ---
    private double threshold;

    // --- volatility ---
    private String field = DEFAULT_VOLATILITY_FIELD;

    /** Recorded and matched, but never returned by probability queries. */
    private boolean hidden;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if required fields are missing or invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Event 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Event 'type' is required");
        }
        try {
            RuleSeverity.fromValue(String.valueOf(severity));
        } catch (IllegalArgumentException e) {
            errors.add("Event '" + name + "': " + e.getMessage());
        }
        try {
            EventCategory.fromValue(String.valueOf(category));
        } catch (IllegalArgumentException e) {
            errors.add("Event '" + name + "': " + e.getMessage());
        }

        if (type != null) {
            switch (type) {
                case "crypto_move" -> {
                    if (asset == null || asset.isBlank()) {
                        errors.add("Crypto event '" + name + "' requires 'asset'");
                    }
                    if (!"pump".equals(direction) && !"dump".equals(direction)) {
                        errors.add("Crypto event '" + name + "' requires 'direction' pump or dump");
                    }
                    if (hours <= 0) {
                        errors.add("Crypto event '" + name + "' requires 'hours' > 0");
                    }
                    requirePositiveThreshold(errors);
                }
                case "volatility" -> {
                    if (field == null || field.isBlank()) {
                        errors.add("Volatility event '" + name + "' requires 'field'");
                    }
                    requirePositiveThreshold(errors);
                }
                case "earthquake", "solar_storm", "kp_index", "news_spike" -> requirePositiveThreshold(errors);
                case "blockchain" -> {
                    if (threshold < 1) {
                        errors.add("Blockchain event '" + name + "' requires 'threshold' >= 1");
                    }
                }
                case "randomness" -> {
                    if (threshold <= 0 || threshold > 1) {
                        errors.add("Randomness event '" + name + "' requires 'threshold' in (0, 1]");
                    }
                }
                default -> errors.add("Unknown event type: '" + type + "'. Supported: crypto_move, "
                        + "volatility, earthquake, solar_storm, kp_index, blockchain, news_spike, randomness");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid EventDefinition: " + String.join("; ", errors));
        }
    }

    private void requirePositiveThreshold(List<String> errors) {
        if (threshold <= 0) {
            errors.add("Event '" + name + "' requires 'threshold' > 0");
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the rule type, normalised to lowercase.
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    /**
     * @return the description, falling back to the event name
     */
    public String getDescription() {
        return description != null ? description : name;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getAsset() {
        return asset;
    }

    /**
     * Set the crypto asset symbol, normalised to uppercase.
     */
    public void setAsset(String asset) {
        this.asset = asset != null ? asset.toUpperCase(Locale.ROOT) : null;
    }

    public String getDirection() {
        return direction;
    }

    public void setDirection(String direction) {
        this.direction = direction != null ? direction.toLowerCase(Locale.ROOT) : null;
    }

    public int getHours() {
        return hours;
    }

    public void setHours(int hours) {
        this.hours = hours;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public boolean isHidden() {
        return hidden;
    }

    public void setHidden(boolean hidden) {
        this.hidden = hidden;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EventDefinition that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "EventDefinition{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", severity='" + severity + '\'' +
                ", category='" + category + '\'' +
                ", asset='" + asset + '\'' +
                ", direction='" + direction + '\'' +
                ", hours=" + hours +
                ", threshold=" + threshold +
                ", hidden=" + hidden +
                '}';
    }
}
