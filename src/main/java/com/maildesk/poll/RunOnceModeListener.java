package com.maildesk.poll;

import com.maildesk.config.MailDeskProperties;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.ConfigurableEnvironment;

/**
 * Turns the web server off for run-once mode.
 * Runs once the environment is prepared, so maildesk.poll.mode is read from every
 * property source (application.yml, environment variables, command line) before
 * the application context is created.
 */
public class RunOnceModeListener implements ApplicationListener<ApplicationEnvironmentPreparedEvent> {

    static final String POLL_PREFIX = "maildesk.poll";

    @Override
    public void onApplicationEvent(ApplicationEnvironmentPreparedEvent event) {
        if (isRunOnce(event.getEnvironment())) {
            event.getSpringApplication().setWebApplicationType(WebApplicationType.NONE);
        }
    }

    static boolean isRunOnce(ConfigurableEnvironment environment) {
        return Binder.get(environment)
                .bind(POLL_PREFIX, MailDeskProperties.Poll.class)
                .map(MailDeskProperties.Poll::isRunOnce)
                .orElse(false);
    }
}
