package cn.bafuka.knowsearch.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * KnowSearch 示例应用启动类
 */
@SpringBootApplication
public class KnowSearchExampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(KnowSearchExampleApplication.class, args);
        System.out.println("\n========================================");
        System.out.println("  KnowSearch Example Application Started!");
        System.out.println("========================================\n");
    }
}
