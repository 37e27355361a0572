package com.slb.reward_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.slb.reward_ledger")
public class RewardLedgerApplication {

	public static void main(String[] args) {
		SpringApplication.run(RewardLedgerApplication.class, args);
	}

}
