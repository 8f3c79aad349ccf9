package com.hybridchat.ai.api;

import com.hybridchat.ai.chat.ChatReply;
import com.hybridchat.ai.chat.ChatService;
import com.hybridchat.ai.model.ChatRequest;
import com.hybridchat.ai.model.ChatResponse;
import com.hybridchat.ai.model.MemoryDetails;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

@RestController
@RequestMapping("/chat")
public class ChatController {

  private final ChatService chatService;

  public ChatController(ChatService chatService) {
    this.chatService = chatService;
  }

  @PostMapping
  public ChatResponse chat(@RequestBody ChatRequest req) {
    ChatReply reply = chatService.chat(req.conversationId(), req.query());
    return new ChatResponse(reply.answer(), MemoryDetails.from(reply.memory()));
  }

  @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<String> chatStream(@RequestBody ChatRequest req) {
    return chatService.chatStream(req.conversationId(), req.query());
  }
}
