package com.cropchain.trackingservice.config;

import com.cropchain.trackingservice.repository.CounterRepository;
import com.cropchain.trackingservice.repository.CropBatchRepository;
import com.cropchain.trackingservice.repository.impl.CounterRepositoryImpl;
import com.cropchain.trackingservice.repository.impl.CropBatchRepositoryImpl;
import com.google.cloud.firestore.Firestore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EntityConfiguration {

    @Bean
    CounterRepository counterRepository(Firestore firestore) {
        return new CounterRepositoryImpl(firestore);
    }

    @Bean
    CropBatchRepository cropBatchRepository(Firestore firestore) {
        return new CropBatchRepositoryImpl(firestore);
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
