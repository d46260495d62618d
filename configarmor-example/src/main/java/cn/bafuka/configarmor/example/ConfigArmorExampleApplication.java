package cn.bafuka.configarmor.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ConfigArmor 示例应用启动类
 * 启动前需设置环境变量 DB_CONNECTION_STRING
 */
@SpringBootApplication
public class ConfigArmorExampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConfigArmorExampleApplication.class, args);
        System.out.println("\n========================================");
        System.out.println("  ConfigArmor Example Application Started!");
        System.out.println("  Diagnostics: http://localhost:8080/api/diagnostic/cache");
        System.out.println("========================================\n");
    }
}
