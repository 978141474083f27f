package com.example.dutyroster.roster;

import com.example.dutyroster.person.Person;
import com.example.dutyroster.post.Post;
import jakarta.persistence.*;

import java.time.LocalDate;

@Entity
@Table(name = "allocations",
        uniqueConstraints = @UniqueConstraint(name = "uk_allocation_post_date", columnNames = {"post_id", "duty_date"}))
public class Allocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "person_id", nullable = false)
    private Person person;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "post_id", nullable = false)
    private Post post;

    @Column(name = "duty_date", nullable = false)
    private LocalDate date;

    // debt repayment: invisible to fairness counters
    @Column(name = "is_punishment", nullable = false)
    private Boolean punishment = false;

    // whose balance was consumed; stays put when the allocation changes hands
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "punished_person_id")
    private Person punishedPerson;

    protected Allocation() {
    }

    public Allocation(Person person, Post post, LocalDate date, boolean punishment) {
        this.person = person;
        this.post = post;
        this.date = date;
        this.punishment = punishment;
        this.punishedPerson = punishment ? person : null;
    }

    public boolean isHeldBy(Long personId) {
        return person != null && person.getId().equals(personId);
    }

    public Long getId() {
        return id;
    }

    public Person getPerson() {
        return person;
    }

    public void setPerson(Person person) {
        this.person = person;
    }

    public Post getPost() {
        return post;
    }

    public LocalDate getDate() {
        return date;
    }

    public boolean isPunishment() {
        return Boolean.TRUE.equals(punishment);
    }

    public Person getPunishedPerson() {
        return punishedPerson;
    }
}
