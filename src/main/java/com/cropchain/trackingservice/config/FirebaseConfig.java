package com.cropchain.trackingservice.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.cloud.FirestoreClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Builds the Firestore client from the Firebase Admin SDK.
 * <p>
 * When {@code FIRESTORE_EMULATOR_HOST} is set in the environment the client talks to the
 * emulator instead of the project.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class FirebaseConfig {

    private final BatchProperties properties;

    @Bean
    public FirebaseApp firebaseApp() throws IOException {
        if (!FirebaseApp.getApps().isEmpty()) {
            return FirebaseApp.getInstance();
        }

        BatchProperties.Firebase firebase = properties.getFirebase();
        FirebaseOptions.Builder options = FirebaseOptions.builder()
                .setCredentials(loadCredentials(firebase.getCredentialsPath()));
        if (StringUtils.hasText(firebase.getProjectId())) {
            options.setProjectId(firebase.getProjectId());
        }

        log.info("Initializing Firebase app for project {}", firebase.getProjectId());
        return FirebaseApp.initializeApp(options.build());
    }

    @Bean
    public Firestore firestore(FirebaseApp firebaseApp) {
        return FirestoreClient.getFirestore(firebaseApp);
    }

    private static GoogleCredentials loadCredentials(String credentialsPath) throws IOException {
        if (!StringUtils.hasText(credentialsPath)) {
            return GoogleCredentials.getApplicationDefault();
        }
        try (InputStream serviceAccount = new FileInputStream(credentialsPath)) {
            return GoogleCredentials.fromStream(serviceAccount);
        } catch (IOException e) {
            log.error("Error loading service account from {}", credentialsPath, e);
            throw e;
        }
    }
}
