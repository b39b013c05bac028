package me.golemcore.scheduler.adapter.outbound.delivery;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.scheduler.domain.model.DeliveryReceipt;
import me.golemcore.scheduler.domain.model.DeliveryRequest;
import me.golemcore.scheduler.port.outbound.DeliveryPort;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Fallback {@link DeliveryPort} used when no chat transport is wired in. Writes
 * each delivery to the log and answers with a generated message id, so
 * threaded jobs still get a stable thread to reply into.
 */
@Slf4j
public class LoggingDeliveryAdapter implements DeliveryPort {

    @Override
    public CompletableFuture<DeliveryReceipt> deliver(DeliveryRequest request) {
        String messageId = UUID.randomUUID().toString();
        if (request.threadId() != null) {
            log.info("[Delivery] #{} (thread {}) job {}: {}", request.deliveryRoom(), request.threadId(),
                    request.jobId(), request.message());
        } else {
            log.info("[Delivery] #{} job {}: {}", request.deliveryRoom(), request.jobId(), request.message());
        }
        return CompletableFuture.completedFuture(new DeliveryReceipt(messageId, request.threadId(), null));
    }
}
