package com.aliasmail.service;

import com.aliasmail.domain.MessageRecord;
import com.aliasmail.domain.MessageStatus;
import com.aliasmail.mapper.MessageRecordMapper;
import org.apache.ibatis.session.Configuration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mybatis.spring.SqlSessionFactoryBean;
import org.mybatis.spring.SqlSessionTemplate;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Delivery record tests against an in-memory SQLite store built from schema.sql
 */
class DeliveryRecordServiceSqliteTest {

    private SingleConnectionDataSource dataSource;
    private JdbcTemplate jdbcTemplate;
    private DeliveryRecordService recordService;

    @BeforeEach
    void setUp() throws Exception {
        // One shared connection; every new :memory: connection would open an empty database
        dataSource = new SingleConnectionDataSource("jdbc:sqlite::memory:", true);
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);

        Configuration configuration = new Configuration();
        configuration.setMapUnderscoreToCamelCase(true);
        SqlSessionFactoryBean factoryBean = new SqlSessionFactoryBean();
        factoryBean.setDataSource(dataSource);
        factoryBean.setConfiguration(configuration);
        factoryBean.setMapperLocations(new ClassPathResource("mapper/MessageRecordMapper.xml"));

        SqlSessionTemplate sqlSession = new SqlSessionTemplate(factoryBean.getObject());
        recordService = new DeliveryRecordService(sqlSession.getMapper(MessageRecordMapper.class));
    }

    @AfterEach
    void tearDown() {
        dataSource.destroy();
    }

    private static MessageRecord record(String recipient) {
        return MessageRecord.builder()
                .messageId("<resent@store.example>")
                .senderEmail("orders@store.example")
                .recipientEmail(recipient)
                .subject("Your order")
                .sizeBytes(120)
                .build();
    }

    @Test
    @DisplayName("Resent message with the same Message-ID gets its own record")
    void testResentMessageRecorded() {
        MessageRecord first = recordService.startProcessing(record("shop@hosted.com"));
        MessageRecord second = recordService.startProcessing(record("shop@hosted.com"));

        assertThat(first.getId()).isNotNull();
        assertThat(second.getId()).isNotNull().isNotEqualTo(first.getId());
        assertThat(first.getMessageId()).isEqualTo("<resent@store.example>");
        assertThat(second.getMessageId()).startsWith("<resent@store.example>#");
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM messages WHERE status = 'PROCESSING'",
                Integer.class)).isEqualTo(2);
    }

    @Test
    @DisplayName("Terminal status is stored once")
    void testCompleteStored() {
        MessageRecord record = recordService.startProcessing(record("shop@hosted.com"));

        assertThat(recordService.complete(record, MessageStatus.DELIVERED, "me@gmail.com", null)).isTrue();
        assertThat(recordService.complete(record, MessageStatus.FAILED, null, "late")).isFalse();

        assertThat(jdbcTemplate.queryForObject("SELECT status FROM messages WHERE id = ?",
                String.class, record.getId())).isEqualTo("DELIVERED");
        assertThat(jdbcTemplate.queryForObject("SELECT forwarded_to FROM messages WHERE id = ?",
                String.class, record.getId())).isEqualTo("me@gmail.com");
    }
}
