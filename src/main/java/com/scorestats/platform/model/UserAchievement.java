package com.scorestats.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The fact that a user has been awarded a medal. Append only.
 */
@Entity
@Table(name = "osu_user_achievements")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@IdClass(UserAchievementId.class)
public class UserAchievement {
    @Id
    @Column(name = "user_id", nullable = false)
    private int userId;
    
    @Id
    @Column(name = "achievement_id", nullable = false)
    private int achievementId;
    
    @Column(name = "beatmap_id")
    private Integer beatmapId;
    
    @Column(name = "date", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant date;
}
