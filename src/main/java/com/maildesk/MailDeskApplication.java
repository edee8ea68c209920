package com.maildesk;

import com.maildesk.config.MailDeskProperties;
import com.maildesk.poll.PollRunner;
import com.maildesk.poll.RunOnceModeListener;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * MailDesk support ticket ingestion
 *
 * Polls a mailbox and turns messages into support tickets
 * - Jakarta Mail POP3/IMAP polling
 * - MyBatis + SQLite persistence
 * - Seen-message store and conversation identity registry
 * - Filesystem attachment store
 * - Prometheus metrics monitoring
 *
 * With maildesk.poll.mode=once a single cycle runs and the process exits:
 * 0 after a clean cycle, 2 when the mail server was unreachable, 1 when startup failed.
 */
@SpringBootApplication
@MapperScan("com.maildesk.mapper")
@EnableConfigurationProperties
@EnableScheduling
public class MailDeskApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(MailDeskApplication.class);
        app.addListeners(new RunOnceModeListener());
        ConfigurableApplicationContext context = app.run(args);

        if (context.getBean(MailDeskProperties.class).getPoll().isRunOnce()) {
            int code = context.getBean(PollRunner.class).runOnce();
            System.exit(SpringApplication.exit(context, () -> code));
        }
    }
}
