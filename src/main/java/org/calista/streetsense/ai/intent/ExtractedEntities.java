package org.calista.streetsense.ai.intent;

import java.util.List;
import java.util.Objects;

/**
 * Shallow entities pulled out of the input by the pattern matcher.
 * Absent values are null; {@code numbers} is never null.
 */
public final class ExtractedEntities {

    public static final ExtractedEntities NONE = new ExtractedEntities(null, List.of(), null, null, null);

    public final String playerName;
    public final List<Integer> numbers;
    public final String crimeType;
    public final String jobType;
    public final String district;

    public ExtractedEntities(String playerName, List<Integer> numbers, String crimeType, String jobType, String district) {
        this.playerName = playerName;
        this.numbers = numbers == null ? List.of() : List.copyOf(numbers);
        this.crimeType = crimeType;
        this.jobType = jobType;
        this.district = district;
    }

    public boolean isEmpty() {
        return playerName == null && numbers.isEmpty() && crimeType == null && jobType == null && district == null;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof ExtractedEntities e)) return false;
        return Objects.equals(playerName, e.playerName)
                && numbers.equals(e.numbers)
                && Objects.equals(crimeType, e.crimeType)
                && Objects.equals(jobType, e.jobType)
                && Objects.equals(district, e.district);
    }

    @Override
    public int hashCode() {
        return Objects.hash(playerName, numbers, crimeType, jobType, district);
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder("{");
        if (playerName != null) b.append("player=").append(playerName).append(' ');
        if (!numbers.isEmpty()) b.append("numbers=").append(numbers).append(' ');
        if (crimeType != null) b.append("crime=").append(crimeType).append(' ');
        if (jobType != null) b.append("job=").append(jobType).append(' ');
        if (district != null) b.append("district=").append(district).append(' ');
        if (b.length() > 1) b.setLength(b.length() - 1);
        return b.append('}').toString();
    }
}
