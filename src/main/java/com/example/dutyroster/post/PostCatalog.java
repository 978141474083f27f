package com.example.dutyroster.post;

import com.example.dutyroster.config.CacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 生成順に並べたポスト一覧をキャッシュして提供する。
 * ポストを追加・変更した場合は {@link #register(Post)} か {@link #evict()} でキャッシュを破棄すること。
 */
@Service
public class PostCatalog {

    private static final Logger logger = LoggerFactory.getLogger(PostCatalog.class);

    private final PostRepository postRepository;

    public PostCatalog(PostRepository postRepository) {
        this.postRepository = postRepository;
    }

    @Cacheable(CacheConfig.POSTS)
    public List<Post> orderedPosts() {
        List<Post> posts = postRepository.findAllByOrderByPriorityDescNameAscIdAsc();
        logger.debug("ポスト一覧を読み込みました: {}件", posts.size());
        return List.copyOf(posts);
    }

    @CacheEvict(value = CacheConfig.POSTS, allEntries = true)
    @Transactional
    public Post register(Post post) {
        Post saved = postRepository.save(post);
        logger.info("ポストを登録しました: {} (優先度={}, 学年={})",
                saved.getName(), saved.getPriority(), saved.getAllowedYears());
        return saved;
    }

    @CacheEvict(value = CacheConfig.POSTS, allEntries = true)
    public void evict() {
        logger.debug("ポストキャッシュを破棄しました");
    }
}
