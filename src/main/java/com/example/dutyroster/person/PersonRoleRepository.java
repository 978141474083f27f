package com.example.dutyroster.person;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;

@Repository
public interface PersonRoleRepository extends JpaRepository<PersonRole, Long> {

    boolean existsByPersonIdAndRoleIn(Long personId, Collection<Role> roles);
}
