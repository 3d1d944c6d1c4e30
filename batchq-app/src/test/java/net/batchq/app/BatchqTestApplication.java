package net.batchq.app;

import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BatchqTestApplication {
}
