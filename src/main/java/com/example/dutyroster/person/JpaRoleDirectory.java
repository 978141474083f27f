package com.example.dutyroster.person;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.Set;

@Component
public class JpaRoleDirectory implements RoleDirectory {

    private final PersonRoleRepository personRoleRepository;

    public JpaRoleDirectory(PersonRoleRepository personRoleRepository) {
        this.personRoleRepository = personRoleRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasRole(Long personId, Role role) {
        if (personId == null || role == null) {
            return false;
        }
        // admin implies scheduler rights
        Set<Role> accepted = role == Role.SCHEDULER ? EnumSet.of(Role.SCHEDULER, Role.ADMIN) : EnumSet.of(role);
        return personRoleRepository.existsByPersonIdAndRoleIn(personId, accepted);
    }
}
