package com.eainde.salary.controller;

/**
 * Built-in sample profile served by {@code GET /salary-estimates/example}.
 */
final class ExampleProfile {

    static final String TEXT = """
            John Smith
            Senior Software Engineer at Google

            San Francisco Bay Area

            About:
            Experienced software engineer with 7 years of experience building scalable distributed systems.
            Currently working on Google Cloud Platform infrastructure.

            Experience:
            - Senior Software Engineer at Google (2021 - Present, 3 years)
              Working on GCP Compute Engine, Kubernetes integration, and cloud infrastructure.

            - Software Engineer at Stripe (2019 - 2021, 2 years)
              Built payment processing systems and fraud detection pipelines.

            - Software Engineer at Airbnb (2017 - 2019, 2 years)
              Developed search ranking algorithms and backend services.

            Education:
            - M.S. Computer Science, Stanford University
            - B.S. Computer Science, UC Berkeley

            Skills:
            Python, Go, Java, Kubernetes, Distributed Systems, Machine Learning, AWS, GCP, System Design
            """;

    private ExampleProfile() {
    }
}
