package com.xgpt.search.store;

import com.xgpt.search.model.TweetRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import static com.xgpt.search.store.SqlValues.flag;
import static com.xgpt.search.store.SqlValues.millis;

@Repository
@RequiredArgsConstructor
public class TweetRepository {

    private final JdbcTemplate jdbcTemplate;

    public boolean exists(String id) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM tweets WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    /**
     * Inserts the tweet unless a row with the same id already exists.
     *
     * @return false when the id was already stored; the existing row is left untouched
     */
    public boolean insert(TweetRecord tweet) {
        int rows = jdbcTemplate.update("""
                INSERT INTO tweets
                (id, text, user_id, username, created_at, scraped_at, is_retweet, is_reply,
                 like_count, retweet_count, reply_count, metadata)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (id) DO NOTHING
                """,
                tweet.getId(),
                tweet.getText(),
                tweet.getUserId(),
                tweet.getUsername(),
                millis(tweet.getCreatedAt()),
                millis(tweet.getScrapedAt()),
                flag(tweet.isRetweet()),
                flag(tweet.isReply()),
                tweet.getLikes(),
                tweet.getRetweets(),
                tweet.getReplies(),
                tweet.getMetadata());
        return rows > 0;
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tweets", Long.class);
        return count == null ? 0 : count;
    }
}
