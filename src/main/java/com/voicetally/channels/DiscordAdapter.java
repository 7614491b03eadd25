package com.voicetally.channels;

import com.voicetally.commands.TrackerCommands;
import com.voicetally.reporting.ReportTarget;
import com.voicetally.shared.config.VoiceTallyConfig;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import net.dv8tion.jda.api.entities.channel.concrete.VoiceChannel;
import net.dv8tion.jda.api.entities.channel.middleman.AudioChannel;
import net.dv8tion.jda.api.events.guild.voice.GuildVoiceUpdateEvent;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.utils.MemberCachePolicy;
import net.dv8tion.jda.api.utils.cache.CacheFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

public class DiscordAdapter extends ListenerAdapter {

    private static final Logger log = LoggerFactory.getLogger(DiscordAdapter.class);

    private final VoiceTallyConfig config;
    private final Clock clock;
    private JDA jda;
    private PresenceSink sink;
    private TrackerCommands commands;
    // set once the guild and channels have been validated; events before that are dropped
    private volatile ReportTarget reportTarget;

    public DiscordAdapter(VoiceTallyConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public void start(PresenceSink sink, TrackerCommands commands) {
        this.sink = sink;
        this.commands = commands;
        try {
            jda = JDABuilder.createDefault(config.discordToken())
                    .enableIntents(GatewayIntent.GUILD_VOICE_STATES)
                    .enableCache(CacheFlag.VOICE_STATE)
                    .setMemberCachePolicy(MemberCachePolicy.VOICE)
                    .addEventListeners(this)
                    .build();
            jda.awaitReady();
            log.info("Connected as {} ({})", jda.getSelfUser().getName(), jda.getSelfUser().getId());
        } catch (Exception e) {
            throw new RuntimeException("Failed to start Discord bot", e);
        }

        var guild = jda.getGuildById(config.guildId());
        if (guild == null) {
            fail("Configured guild " + config.guildId() + " not found");
        }
        VoiceChannel tracked = guild.getVoiceChannelById(config.trackedVoiceChannelId());
        if (tracked == null) {
            fail("Tracked channel " + config.trackedVoiceChannelId() + " is missing or not a voice channel");
        }
        TextChannel report = guild.getTextChannelById(config.reportChannelId());
        if (report == null) {
            fail("Report channel " + config.reportChannelId() + " is missing or not a text channel");
        }
        if (!guild.getSelfMember().hasPermission(report, Permission.VIEW_CHANNEL, Permission.MESSAGE_SEND)) {
            fail("Missing view/send permission in report channel " + report.getId());
        }
        log.info("Runtime checks passed");

        guild.updateCommands().addCommands(
                Commands.slash(TrackerCommands.STATUS, "Show bot status and cooldown info"),
                Commands.slash(TrackerCommands.TODAY, "Show today's tracked totals so far"),
                Commands.slash(TrackerCommands.REPORT_NOW, "Post a manual day-so-far report")
        ).queue(null, err -> log.error("Failed to register slash commands", err));

        // bots never count towards tracked totals
        var present = tracked.getMembers().stream()
                .filter(m -> !m.getUser().isBot())
                .map(Member::getId)
                .toList();
        sink.snapshot(present, clock.instant());

        reportTarget = new ReportTarget(
                userId -> Optional.ofNullable(guild.getMemberById(userId)).map(Member::getEffectiveName),
                content -> sendReport(report.getIdLong(), content),
                tracked.getName());
    }

    public Optional<ReportTarget> reportTarget() {
        return Optional.ofNullable(reportTarget);
    }

    @Override
    public void onGuildVoiceUpdate(GuildVoiceUpdateEvent event) {
        if (reportTarget == null) return;
        var member = event.getMember();
        if (member.getUser().isBot()) return;
        if (event.getGuild().getIdLong() != config.guildId()) return;

        VoiceTransitions.translate(
                config.trackedVoiceChannelId(),
                member.getId(),
                idOf(event.getChannelLeft()),
                idOf(event.getChannelJoined()),
                clock.instant()
        ).ifPresent(sink::accept);
    }

    @Override
    public void onSlashCommandInteraction(SlashCommandInteractionEvent event) {
        Guild guild = event.getGuild();
        if (guild == null || guild.getIdLong() != config.guildId()) {
            event.reply("This command can only be used in the configured server.").setEphemeral(true).queue();
            return;
        }
        event.deferReply(true).queue();
        String reply;
        try {
            reply = commands.handle(event.getName(), clock.instant());
        } catch (RuntimeException e) {
            log.error("/{} failed", event.getName(), e);
            reply = "Command failed: `" + e.getMessage() + "`";
        }
        event.getHook().sendMessage(reply).queue(
                null,
                err -> log.error("Failed to reply to /{}", event.getName(), err)
        );
    }

    public void stop() {
        if (jda != null) {
            jda.shutdown();
        }
    }

    private void sendReport(long channelId, String content) {
        var channel = jda.getTextChannelById(channelId);
        if (channel == null) {
            throw new IllegalStateException("Report channel not found: " + channelId);
        }
        channel.sendMessage(content).setAllowedMentions(List.of()).complete();
    }

    private void fail(String message) {
        log.error(message);
        jda.shutdown();
        throw new IllegalStateException(message);
    }

    private static Long idOf(AudioChannel channel) {
        return channel == null ? null : channel.getIdLong();
    }
}
