package herald.server;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import herald.common.configuration.CorsProperties;
import herald.common.configuration.HttpProperties;
import herald.common.configuration.SseProperties;
import herald.netty.http.HeraldExceptionHandler;
import herald.netty.http.HttpRequestDecoder;
import herald.netty.http.SseSubscribeHandler;
import herald.sse.EventStreamService;
import io.netty.bootstrap.AbstractBootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.ServerSocketChannel;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.cors.CorsConfig;
import io.netty.handler.codec.http.cors.CorsConfigBuilder;
import io.netty.handler.codec.http.cors.CorsHandler;
import io.netty.handler.logging.LoggingHandler;

public class Server {

    private static final Logger log = LoggerFactory.getLogger(Server.class);

    private HttpProperties httpProperties;
    private SseProperties sseProperties;
    protected EventStreamService eventStreamService;
    protected ApplicationContext applicationContext;

    private int shutdownQuietPeriod;
    private EventLoopGroup httpWorkerGroup = null;
    private EventLoopGroup httpBossGroup = null;
    protected Channel httpChannelHandle = null;
    protected ExecutorService streamExecutor = null;

    private static boolean useEpoll() {
        if (Epoll.isAvailable()) {
            return true;
        }
        log.debug("Epoll not available: {}", Epoll.unavailabilityCause() == null ? "unknown" : Epoll.unavailabilityCause().getMessage());
        return false;
    }

    public Server(ApplicationContext applicationContext, EventStreamService eventStreamService, HttpProperties httpProperties, SseProperties sseProperties) {
        this.applicationContext = applicationContext;
        this.eventStreamService = eventStreamService;
        this.httpProperties = httpProperties;
        this.sseProperties = sseProperties;
    }

    public void start() {
        log.info("Starting {}", this.getClass().getSimpleName());
        try {
            shutdownQuietPeriod = httpProperties.getShutdownQuietPeriod();
            final boolean useEpoll = useEpoll();
            Class<? extends ServerSocketChannel> channelClass;
            if (useEpoll) {
                httpWorkerGroup = new EpollEventLoopGroup();
                httpBossGroup = new EpollEventLoopGroup();
                channelClass = EpollServerSocketChannel.class;
            } else {
                httpWorkerGroup = new NioEventLoopGroup();
                httpBossGroup = new NioEventLoopGroup();
                channelClass = NioServerSocketChannel.class;
            }
            log.info("Using channel class {}", channelClass.getSimpleName());

            // one thread per open stream, each blocks on its subscriber queue
            streamExecutor = Executors.newCachedThreadPool(new ThreadFactoryBuilder().setNameFormat("sse-stream-%d").setDaemon(true).build());

            log.info("Creating http server");
            final int httpPort = httpProperties.getPort();
            final String httpIp = httpProperties.getIp();
            final ServerBootstrap httpServer = new ServerBootstrap();
            httpServer.group(httpBossGroup, httpWorkerGroup);
            httpServer.channel(channelClass);
            httpServer.handler(new LoggingHandler());
            httpServer.childHandler(setupHttpChannelHandler(httpProperties, sseProperties));
            httpServer.option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT);
            httpServer.option(ChannelOption.SO_BACKLOG, 128);
            httpServer.childOption(ChannelOption.SO_KEEPALIVE, true);
            httpChannelHandle = bind(httpServer, httpIp, httpPort);
            final String httpAddress = ((InetSocketAddress) httpChannelHandle.localAddress()).getAddress().getHostAddress();

            eventStreamService.start();
            log.info("HeraldServer started. Listening on {}:{} for event stream subscriptions at {}", httpAddress, getHttpPort(), sseProperties.getPath());
        } catch (Exception e) {
            log.error(e.getMessage(), e);
            if (applicationContext != null) {
                SpringApplication.exit(applicationContext, () -> 0);
            }
            throw new IllegalStateException("Unable to start " + this.getClass().getSimpleName(), e);
        }
    }

    /**
     * @return the port the http channel is bound to, or -1 if not started
     */
    public int getHttpPort() {
        if (httpChannelHandle == null) {
            return -1;
        }
        return ((InetSocketAddress) httpChannelHandle.localAddress()).getPort();
    }

    public void shutdown() {
        // signal every stream to finish before the connections go away
        try {
            log.info("Stopping event stream service");
            eventStreamService.stop();
        } catch (Exception e) {
            log.error(e.getMessage(), e);
        }

        if (httpChannelHandle != null) {
            log.info("Closing httpChannelHandle");
            try {
                httpChannelHandle.close().get();
            } catch (final Exception e) {
                log.error("Channel:" + httpChannelHandle.config() + " -> " + e.getMessage(), e);
            }
        }

        List<Future<?>> groupFutures = new ArrayList<>();

        if (httpBossGroup != null) {
            log.info("Shutting down httpBossGroup");
            groupFutures.add(httpBossGroup.shutdownGracefully(shutdownQuietPeriod, 10, TimeUnit.SECONDS));
        }

        if (httpWorkerGroup != null) {
            log.info("Shutting down httpWorkerGroup");
            groupFutures.add(httpWorkerGroup.shutdownGracefully(shutdownQuietPeriod, 10, TimeUnit.SECONDS));
        }

        groupFutures.parallelStream().forEach(f -> {
            try {
                f.get();
            } catch (final Exception e) {
                log.error("Group:" + f.toString() + " -> " + e.getMessage(), e);
            }
        });

        if (streamExecutor != null) {
            log.info("Shutting down stream executor");
            streamExecutor.shutdownNow();
            try {
                if (!streamExecutor.awaitTermination(sseProperties.getStopTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Stream threads still running after shutdown");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("{} shut down.", this.getClass().getSimpleName());
    }

    protected void setupHttpSocketChannel(SocketChannel ch, HttpProperties httpProperties, SseProperties sseProperties) {
        CorsProperties corsProperties = httpProperties.getCors();
        ch.pipeline().addLast("codec", new HttpServerCodec());
        ch.pipeline().addLast("aggregator", new HttpObjectAggregator(httpProperties.getMaxContentLength()));
        final CorsConfigBuilder ccb;
        if (corsProperties.isAllowAnyOrigin()) {
            ccb = CorsConfigBuilder.forAnyOrigin();
        } else {
            ccb = CorsConfigBuilder.forOrigins(corsProperties.getAllowedOrigins().stream().toArray(String[]::new));
        }
        if (corsProperties.isAllowNullOrigin()) {
            ccb.allowNullOrigin();
        }
        if (corsProperties.isAllowCredentials()) {
            ccb.allowCredentials();
        }
        corsProperties.getAllowedMethods().stream().map(HttpMethod::valueOf).forEach(ccb::allowedRequestMethods);
        corsProperties.getAllowedHeaders().forEach(ccb::allowedRequestHeaders);
        CorsConfig cors = ccb.build();
        log.trace("Cors configuration: {}", cors);
        ch.pipeline().addLast("cors", new CorsHandler(cors));
        ch.pipeline().addLast("queryDecoder", new HttpRequestDecoder(sseProperties));
        ch.pipeline().addLast("subscribe", new SseSubscribeHandler(eventStreamService, streamExecutor));
        ch.pipeline().addLast("error", new HeraldExceptionHandler());
    }

    protected ChannelHandler setupHttpChannelHandler(HttpProperties httpProperties, SseProperties sseProperties) {
        return new ChannelInitializer<SocketChannel>() {

            @Override
            protected void initChannel(SocketChannel ch) {
                setupHttpSocketChannel(ch, httpProperties, sseProperties);
            }
        };
    }

    protected Channel bind(AbstractBootstrap<?,?> server, String ip, int port) {
        Channel channel = null;
        long start = System.currentTimeMillis();
        long now = start;
        int attempts = 0;
        while (channel == null && ((now - start) < 30000) && attempts < 10) {
            try {
                log.trace("Binding to port:" + ip + ":" + port + " attempt " + ++attempts);
                channel = server.bind(ip, port).sync().channel();
            } catch (Throwable t) {
                log.error(t.getMessage() + " Binding to port:" + ip + ":" + port);
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            now = System.currentTimeMillis();
        }
        if (channel == null) {
            throw new IllegalStateException("Failed to bind to port:" + ip + ":" + port);
        }
        log.trace("Successfully bound to port:" + ip + ":" + port + " in " + attempts + " attempts (" + (now - start) + "ms)");
        return channel;
    }
}
