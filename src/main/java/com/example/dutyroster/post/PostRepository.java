package com.example.dutyroster.post;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PostRepository extends JpaRepository<Post, Long> {

    /**
     * 生成順（優先度の高い順、同順位は名前順）で全ポストを取得
     */
    List<Post> findAllByOrderByPriorityDescNameAscIdAsc();
}
