package com.example.dutyroster.person;

import jakarta.persistence.*;

@Entity
@Table(name = "person_roles",
        uniqueConstraints = @UniqueConstraint(columnNames = {"person_id", "role"}))
public class PersonRole {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "person_id", nullable = false)
    private Long personId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Role role;

    protected PersonRole() {
    }

    public PersonRole(Long personId, Role role) {
        this.personId = personId;
        this.role = role;
    }

    public Long getId() {
        return id;
    }

    public Long getPersonId() {
        return personId;
    }

    public Role getRole() {
        return role;
    }
}
