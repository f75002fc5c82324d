package com.slb.payout_backend;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.slb.payout_backend")
@MapperScan("com.slb.payout_backend.modules.*.mapper")
public class PayoutBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(PayoutBackendApplication.class, args);
	}

}
