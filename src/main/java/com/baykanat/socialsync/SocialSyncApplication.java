package com.baykanat.socialsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Uygulama giriş noktası; cron işleri SyncJobOrchestrator tarafından açılışta planlanır. */
@SpringBootApplication
public class SocialSyncApplication {

	public static void main(String[] args) {
		SpringApplication.run(SocialSyncApplication.class, args);
	}

}
