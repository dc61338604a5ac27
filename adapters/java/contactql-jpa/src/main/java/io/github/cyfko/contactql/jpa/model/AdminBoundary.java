package io.github.cyfko.contactql.jpa.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * An administrative boundary: a state (level 1), district (level 2) or ward (level 3).
 */
@Entity
@Table(name = "admin_boundaries")
public class AdminBoundary {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(name = "boundary_level", nullable = false)
    private int level;

    /** Full path from the country, e.g. {@code Rwanda > Eastern Province > Gatsibo}. */
    @Column(length = 768)
    private String path;

    public AdminBoundary() {}

    public AdminBoundary(String name, int level, String path) {
        this.name = name;
        this.level = level;
        this.path = path;
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

    public int getLevel() {
        return level;
    }

    public void setLevel(int level) {
        this.level = level;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
