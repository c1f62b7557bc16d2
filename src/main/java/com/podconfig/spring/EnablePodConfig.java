package com.podconfig.spring;

import com.podconfig.adapter.spring.PodConfigAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable pod provenance and criticality beans in a Spring Boot application.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnablePodConfig
 * public class NodeAgentApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(NodeAgentApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(PodConfigAutoConfiguration.class)
public @interface EnablePodConfig {
}
