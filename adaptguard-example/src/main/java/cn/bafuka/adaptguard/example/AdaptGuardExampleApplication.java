package cn.bafuka.adaptguard.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AdaptGuard 示例应用启动类
 */
@SpringBootApplication
public class AdaptGuardExampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdaptGuardExampleApplication.class, args);
        System.out.println("\n========================================");
        System.out.println("  AdaptGuard Example Application Started!");
        System.out.println("  System rules: http://localhost:8080/api/system-rules");
        System.out.println("========================================\n");
    }
}
