package com.gt.srs.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.srs.serialization.GradeDeserializer;
import com.gt.srs.serialization.GradeSerializer;

// Quality scores follow the 0-3 scale used by the ease formula
@JsonSerialize(using = GradeSerializer.class)
@JsonDeserialize(using = GradeDeserializer.class)
public enum Grade {
    Again(0),
    Hard(1),
    Good(2),
    Easy(3);

    private final int quality;

    Grade(int quality) {
        this.quality = quality;
    }

    public int getQuality() {
        return quality;
    }

    public static Grade fromQuality(int quality) {
        for (Grade grade : values()) {
            if (grade.quality == quality) {
                return grade;
            }
        }

        return null;
    }

    public static Grade fromName(String name) {
        if (name == null) {
            return null;
        }

        for (Grade grade : values()) {
            if (grade.name().equalsIgnoreCase(name.trim())) {
                return grade;
            }
        }

        return null;
    }
}
