package com.proveground.matchengine.signal;

import com.proveground.matchengine.persistence.ListingEntity;
import com.proveground.matchengine.persistence.StudentEntity;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Case-insensitive comparison of a listing's required skills with a
 * student's skills. Names keep the listing's spelling.
 */
@Data
@AllArgsConstructor
public class SkillMatch {

    private List<String> matched;
    private List<String> missing;

    public static SkillMatch of(StudentEntity student, ListingEntity listing) {
        Set<String> studentSkills = student.normalizedSkillNames();
        List<String> matched = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        for (String required : listing.getSkillsRequired()) {
            if (required == null || required.isBlank()) {
                continue;
            }
            String trimmed = required.trim();
            String normalized = trimmed.toLowerCase(Locale.ROOT);
            if (!seen.add(normalized)) {
                continue;
            }
            if (studentSkills.contains(normalized)) {
                matched.add(trimmed);
            } else {
                missing.add(trimmed);
            }
        }
        return new SkillMatch(matched, missing);
    }

    public int getRequiredCount() {
        return matched.size() + missing.size();
    }
}
