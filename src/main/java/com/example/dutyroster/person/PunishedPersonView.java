package com.example.dutyroster.person;

public record PunishedPersonView(
        Long id,
        String name,
        String classLabel,
        Integer year,
        Integer punishmentBalance
) {
    public static PunishedPersonView from(Person person) {
        return new PunishedPersonView(person.getId(), person.getName(), person.getClassLabel(),
                person.getYear(), person.getPunishmentBalance());
    }
}
