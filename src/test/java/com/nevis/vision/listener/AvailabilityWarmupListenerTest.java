package com.nevis.vision.listener;

import com.nevis.vision.availability.AvailabilityCache;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AvailabilityWarmupListenerTest {

    @Mock
    private AvailabilityCache availabilityCache;

    @InjectMocks
    private AvailabilityWarmupListener listener;

    @Test
    void shouldProbeEveryBackendOnStartup() {
        when(availabilityCache.backendIds()).thenReturn(List.of("image-similarity", "face-recognition"));

        listener.warmUp();

        verify(availabilityCache).probe("image-similarity");
        verify(availabilityCache).probe("face-recognition");
    }
}
