package com.example.dutyroster.post;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 勤務ポスト（参照データ）。管理ツール側で作成・編集される。
 */
@Entity
@Table(name = "posts")
public class Post {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    @NotBlank(message = "ポスト名は必須です")
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "gender_restriction", nullable = false, length = 10)
    @NotNull
    private GenderRestriction genderRestriction = GenderRestriction.MIXED;

    // e.g. "1,2"
    @Column(name = "allowed_years", nullable = false)
    @Pattern(regexp = "\\s*\\d+\\s*(,\\s*\\d+\\s*)*", message = "対象学年はカンマ区切りの数値で入力してください")
    private String allowedYears;

    // display ordering only
    @Column(nullable = false)
    private Integer priority = 1;

    protected Post() {
    }

    public Post(String name, GenderRestriction genderRestriction, String allowedYears, int priority) {
        this.name = name;
        this.genderRestriction = genderRestriction;
        this.allowedYears = allowedYears;
        this.priority = priority;
    }

    /**
     * 学年は厳密なメンバーシップで判定する（範囲ではない）。
     */
    public boolean acceptsYear(int year) {
        return allowedYearSet().contains(year);
    }

    public Set<Integer> allowedYearSet() {
        if (allowedYears == null || allowedYears.isBlank()) {
            return Collections.emptySet();
        }
        Set<Integer> years = new TreeSet<>();
        for (String token : allowedYears.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                years.add(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                throw new IllegalStateException("ポスト '" + name + "' の対象学年が不正です: " + allowedYears, e);
            }
        }
        return years;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public GenderRestriction getGenderRestriction() {
        return genderRestriction;
    }

    public void setGenderRestriction(GenderRestriction genderRestriction) {
        this.genderRestriction = genderRestriction;
    }

    public String getAllowedYears() {
        return allowedYears;
    }

    public void setAllowedYears(String allowedYears) {
        this.allowedYears = allowedYears;
    }

    public Integer getPriority() {
        return priority;
    }

    public void setPriority(Integer priority) {
        this.priority = priority;
    }
}
