package com.example.dutyroster.config;

import com.example.dutyroster.person.Gender;
import com.example.dutyroster.person.Person;
import com.example.dutyroster.person.PersonRepository;
import com.example.dutyroster.person.PersonRole;
import com.example.dutyroster.person.PersonRoleRepository;
import com.example.dutyroster.person.Role;
import com.example.dutyroster.post.GenderRestriction;
import com.example.dutyroster.post.Post;
import com.example.dutyroster.post.PostCatalog;
import com.example.dutyroster.post.PostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * demo プロファイル用の初期データ。ストアが空の場合のみ投入する。
 */
@Component
@Profile("demo")
public class DemoDataInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(DemoDataInitializer.class);

    private final PostRepository postRepository;
    private final PostCatalog postCatalog;
    private final PersonRepository personRepository;
    private final PersonRoleRepository personRoleRepository;

    public DemoDataInitializer(PostRepository postRepository,
                               PostCatalog postCatalog,
                               PersonRepository personRepository,
                               PersonRoleRepository personRoleRepository) {
        this.postRepository = postRepository;
        this.postCatalog = postCatalog;
        this.personRepository = personRepository;
        this.personRoleRepository = personRoleRepository;
    }

    @Override
    public void run(String... args) {
        if (postRepository.count() > 0 || personRepository.count() > 0) {
            logger.info("デモデータは既に存在します");
            return;
        }
        logger.info("デモデータの初期化を開始します");

        postCatalog.register(new Post("当直長", GenderRestriction.MIXED, "3", 3));
        postCatalog.register(new Post("正門", GenderRestriction.MIXED, "1,2", 2));
        postCatalog.register(new Post("女子寮", GenderRestriction.F, "1,2,3", 1));
        postCatalog.register(new Post("男子寮", GenderRestriction.M, "1,2,3", 1));

        List<Person> persons = new ArrayList<>();
        String[] classes = {"A", "B"};
        for (int year = 1; year <= 3; year++) {
            for (String classLabel : classes) {
                persons.add(new Person("学生" + year + classLabel + "-男", Gender.M, year + classLabel, year));
                persons.add(new Person("学生" + year + classLabel + "-女", Gender.F, year + classLabel, year));
            }
        }
        persons.get(0).setPunishmentBalance(1);
        personRepository.saveAll(persons);

        Person scheduler = personRepository.save(new Person("勤務担当", Gender.F, "職員", 4));
        personRoleRepository.save(new PersonRole(scheduler.getId(), Role.SCHEDULER));

        logger.info("デモデータを投入しました: ポスト4件, 対象者{}名, 勤務担当者ID={}", persons.size(), scheduler.getId());
    }
}
