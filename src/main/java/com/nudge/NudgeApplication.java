package com.nudge;

import com.nudge.core.ActionItem;
import com.nudge.core.ActionItemReport;
import com.nudge.core.EntityBatch;
import com.nudge.core.EvaluationOptions;
import com.nudge.engine.ActionItemService;
import com.nudge.entity.Applicant;
import com.nudge.entity.ApplicantAdapter;
import com.nudge.entity.EntityReader;
import com.nudge.entity.Lead;
import com.nudge.entity.LeadAdapter;
import com.nudge.priority.Urgency;
import com.nudge.spring.EnableNudge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ClassPathResource;

import java.io.InputStream;
import java.util.List;

/**
 * Example Spring Boot application demonstrating Nudge usage.
 */
@SpringBootApplication
@EnableNudge
public class NudgeApplication {

    private static final Logger log = LoggerFactory.getLogger(NudgeApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(NudgeApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(prefix = "nudge.demo", name = "enabled", havingValue = "true")
    public CommandLineRunner demo(ActionItemService service, EntityReader reader,
                                  ApplicantAdapter applicantAdapter, LeadAdapter leadAdapter) {
        return args -> {
            log.info("=== Nudge Demo Started ===");

            List<Applicant> applicants;
            try (InputStream in = new ClassPathResource("sample-applicants.json").getInputStream()) {
                applicants = reader.readApplicants(in);
            }
            List<Lead> leads;
            try (InputStream in = new ClassPathResource("sample-leads.json").getInputStream()) {
                leads = reader.readLeads(in);
            }
            log.info("Loaded {} applicants and {} leads", applicants.size(), leads.size());

            ActionItemReport report = service.report(
                    List.of(EntityBatch.of(applicants, applicantAdapter), EntityBatch.of(leads, leadAdapter)),
                    EvaluationOptions.defaults());

            for (ActionItem item : report.items()) {
                log.info("{} [{}] {}: {} | {} | {}", item.icon(), item.urgency(), item.name(),
                        item.title(), item.detail(), item.action());
            }

            log.info("=== {} action items ({} critical, {} warning, {} info), showing {} ===",
                    report.total(), report.count(Urgency.CRITICAL), report.count(Urgency.WARNING),
                    report.count(Urgency.INFO), report.showing());
        };
    }
}
