package net.sentiflow.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SentiflowApplication {

    public static void main(String[] args) {
        // 파이프라인 한 번 실행 후 보고서 결과를 종료 코드로
        System.exit(SpringApplication.exit(SpringApplication.run(SentiflowApplication.class, args)));
    }
}
