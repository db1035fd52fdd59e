package com.picfactory.orchestrator.session;

import java.util.List;

/**
 * Selector table for the remote chat surface.
 *
 * Tied to one site's markup; expect to update it when that markup changes.
 * Each list is tried in order and the first visible match wins.
 */
public final class ChatSurfaceSelectors {

    public static final List<String> LOGIN_CTAS = List.of(
            "a:has-text(\"Log in\")",
            "button:has-text(\"Log in\")",
            "a:has-text(\"Sign in\")",
            "button:has-text(\"Sign in\")",
            "button:has-text(\"登录\")",
            "a:has-text(\"登录\")");

    public static final List<String> NEW_CHAT_BUTTONS = List.of(
            "button:has-text(\"New chat\")",
            "a:has-text(\"New chat\")",
            "button:has-text(\"New conversation\")",
            "button:has-text(\"新聊天\")",
            "button[aria-label*=\"New chat\"]",
            "button[data-testid=\"new-chat-button\"]");

    public static final List<String> ATTACH_BUTTONS = List.of(
            "button[aria-label*=\"Attach\"]",
            "button[aria-label*=\"Upload\"]",
            "button[aria-label*=\"Add photos\"]",
            "button[aria-label*=\"上传\"]",
            "button:has-text(\"Upload\")",
            "button:has-text(\"上传\")",
            "button:has-text(\"Add photos\")");

    public static final List<String> FILE_INPUTS = List.of("input[type=\"file\"]");

    public static final List<String> COMPOSER_INPUTS = List.of(
            "textarea#prompt-textarea",
            "textarea[data-testid=\"prompt-textarea\"]",
            "textarea[placeholder*=\"Message\"]",
            "div[contenteditable=\"true\"][role=\"textbox\"]",
            "div[contenteditable=\"true\"][data-lexical-editor=\"true\"]");

    public static final List<String> SEND_BUTTONS = List.of(
            "button[data-testid=\"send-button\"]",
            "button[aria-label*=\"Send\"]",
            "button[aria-label*=\"发送\"]",
            "button:has-text(\"Send\")",
            "button:has-text(\"发送\")",
            "button:has-text(\"Create image\")",
            "button:has-text(\"创建图片\")");

    public static final List<String> ATTACHMENT_INDICATORS = List.of(
            "button[aria-label*=\"Remove attachment\"]",
            "button[aria-label*=\"移除\"]",
            "button[data-testid*=\"remove-attachment\"]",
            "img[alt*=\"Uploaded\"]",
            "img[alt*=\"attachment\"]");

    public static final List<String> RESULT_IMAGES = List.of("main img", "article img");

    public static final List<String> DOWNLOAD_BUTTONS = List.of(
            "button[aria-label*=\"Download\"]",
            "button[aria-label*=\"下载\"]",
            "button:has-text(\"Download\")",
            "button:has-text(\"下载\")",
            "a[download]");

    private ChatSurfaceSelectors() {}
}
