package com.clapgrow.channels.whatsapp.supervisor;

import com.clapgrow.channels.whatsapp.config.WorkerProperties;
import com.clapgrow.channels.whatsapp.ingress.MessageIngressService;
import com.clapgrow.channels.whatsapp.publisher.ChannelStatePublisher;
import com.clapgrow.channels.whatsapp.qr.QrCodeRenderer;
import com.clapgrow.channels.whatsapp.session.SessionStore;
import com.clapgrow.channels.whatsapp.transport.WhatsAppTransport;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Collaborators shared by every {@link ChannelSupervisor}.
 */
@Component
@Getter
public class SupervisorDependencies {

    private final WhatsAppTransport transport;
    private final SessionStore sessionStore;
    private final ChannelStatePublisher publisher;
    private final MessageIngressService ingress;
    private final QrCodeRenderer qrRenderer;
    private final ReconnectPolicy reconnectPolicy;
    private final TaskScheduler scheduler;
    private final Executor channelExecutor;
    private final Executor transportExecutor;
    private final WorkerProperties.Supervisor settings;
    private final Clock clock;

    @Autowired
    public SupervisorDependencies(WhatsAppTransport transport,
                                  SessionStore sessionStore,
                                  ChannelStatePublisher publisher,
                                  MessageIngressService ingress,
                                  QrCodeRenderer qrRenderer,
                                  ReconnectPolicy reconnectPolicy,
                                  @Qualifier("reconnectScheduler") TaskScheduler scheduler,
                                  @Qualifier("channelExecutor") Executor channelExecutor,
                                  @Qualifier("transportExecutor") Executor transportExecutor,
                                  WorkerProperties properties,
                                  Clock clock) {
        this(transport, sessionStore, publisher, ingress, qrRenderer, reconnectPolicy, scheduler,
            channelExecutor, transportExecutor, properties.getSupervisor(), clock);
    }

    public SupervisorDependencies(WhatsAppTransport transport,
                                  SessionStore sessionStore,
                                  ChannelStatePublisher publisher,
                                  MessageIngressService ingress,
                                  QrCodeRenderer qrRenderer,
                                  ReconnectPolicy reconnectPolicy,
                                  TaskScheduler scheduler,
                                  Executor channelExecutor,
                                  Executor transportExecutor,
                                  WorkerProperties.Supervisor settings,
                                  Clock clock) {
        this.transport = transport;
        this.sessionStore = sessionStore;
        this.publisher = publisher;
        this.ingress = ingress;
        this.qrRenderer = qrRenderer;
        this.reconnectPolicy = reconnectPolicy;
        this.scheduler = scheduler;
        this.channelExecutor = channelExecutor;
        this.transportExecutor = transportExecutor;
        this.settings = settings;
        this.clock = clock;
    }
}
